/**
 * Wire Codec
 * =============================================================================
 *
 * <p>Textual, line-oriented encoding of {@link com.questrail.mitm.model.Message}
 * on the simulated network path:</p>
 *
 * <pre>
 *   SEQ=&lt;sequence&gt;|TS=&lt;timestamp&gt;|DATA=&lt;payload&gt;\n
 * </pre>
 *
 * <ul>
 *   <li>Fields are labeled and appear in this fixed order.</li>
 *   <li>{@code DATA} is last, so the payload may contain {@code |} freely.</li>
 *   <li>Backslash, CR and LF inside the payload are escaped, so the newline
 *       terminator is unique on the wire and a byte stream can always be
 *       re-framed on a message boundary after a partial read.</li>
 * </ul>
 *
 * <h2>Placement</h2>
 * <pre>
 *   byte stream
 *        → transport line framing   (transport.tcp.netty)
 *            → MessageDecoder       (this package)
 *                → DetectionEngine
 * </pre>
 *
 * <p>The relay never decodes. It moves frames as opaque bytes so that the
 * destination remains the sole judge of validity.</p>
 */
package com.questrail.mitm.codec;
