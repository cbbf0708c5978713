/**
 * Modbus Transport Port
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between the Modbus exchange client and a
 * concrete TCP implementation (Netty in production, in-memory simulators in
 * tests).</p>
 *
 * <h2>Constraints</h2>
 * Implementations:
 * <ul>
 *   <li>move raw bytes only and never interpret Modbus frames;</li>
 *   <li>never retry or reconnect on their own;</li>
 *   <li>see only {@code byte[]} and JDK types at the port.</li>
 * </ul>
 *
 * <p>Reconnection policy lives in the session loop.</p>
 */
package com.questrail.kducer.protocol.modbus.transport;
