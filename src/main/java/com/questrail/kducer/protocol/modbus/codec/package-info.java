/**
 * Reduced Modbus TCP Frame Codec
 * =============================================================================
 *
 * <p>Builds request ADUs and validates response ADUs for the five function codes
 * the K-Ducer session uses (3, 4, 5, 6, 16). No third-party protocol stack is
 * involved; the whole wire format lives here.</p>
 *
 * <pre>
 *   ADU = MBAP header (7 bytes)              + PDU
 *         tx id | protocol 0 | length | unit   function code | data
 *         u16   | u16        | u16    | u8     u8            | ...
 * </pre>
 *
 * <h2>Boundaries</h2>
 * <ul>
 *   <li>The codec never touches a socket; the exchange client feeds it the
 *       bytes read from the transport.</li>
 *   <li>The codec never interprets register contents. Register payloads leave
 *       it as raw big-endian bytes.</li>
 * </ul>
 */
package com.questrail.kducer.protocol.modbus.codec;
