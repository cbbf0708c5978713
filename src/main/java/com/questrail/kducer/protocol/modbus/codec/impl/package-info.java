/**
 * Default implementations of the frame codec ports.
 *
 * <p>Stateless; one instance may be shared across exchanges.</p>
 */
package com.questrail.kducer.protocol.modbus.codec.impl;
