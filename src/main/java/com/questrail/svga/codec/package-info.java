/**
 * SVGA Codec: Container Boundary
 * =============================================================================
 *
 * <p>This package defines the public codec API for SVGA 2.0 movie containers:
 * the {@link com.questrail.svga.codec.SvgaDecoder} and
 * {@link com.questrail.svga.codec.SvgaEncoder} interfaces, the explicit
 * {@link com.questrail.svga.codec.SvgaCodecContext}, and the fatal error
 * taxonomy.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] container
 *        → SvgaDecoder        (ZIP check, inflate, protobuf parse)
 *            → SvgaDocument   (immutable model, base64 assets)
 *                → LayerSynthesizer (zero or more times)
 *                    → SvgaEncoder (normalize, repair, serialize, deflate)
 *                        → byte[] container
 * </pre>
 *
 * <h2>Failure Model</h2>
 * <ul>
 *   <li>Fatal conditions throw a subclass of
 *       {@link com.questrail.svga.codec.SvgaCodecException}; nothing partial
 *       is returned.</li>
 *   <li>Dangling references and undecodable assets are repaired in place and
 *       reported through the observability sink as advisories.</li>
 * </ul>
 */
package com.questrail.svga.codec;
