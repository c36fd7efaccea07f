/**
 * SVGA Codec: Container Implementation
 * =============================================================================
 *
 * <p>Concrete decoder and encoder for SVGA 2.0 containers.</p>
 *
 * <h2>Wire Format</h2>
 * <ul>
 *   <li>Bytes {@code 0x50 0x4B} at offset 0: legacy SVGA 1.x ZIP, rejected</li>
 *   <li>Otherwise: zlib DEFLATE (or headerless DEFLATE, or nothing) around a
 *       protobuf {@code com.opensource.svga.MovieEntity}</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] container
 *        → ContainerCompression.isLegacyZip
 *        → ContainerCompression.inflate   (zlib → raw → as-is)
 *        → DynamicMessage.parseFrom
 *        → MovieReader
 *        → SvgaDocument
 *
 *   SvgaDocument
 *        → DocumentSanitizer              (KeyRegistry, FieldPolicy)
 *        → MovieWriter
 *        → DynamicMessage.toByteArray
 *        → ContainerCompression.deflate   (optional, level 6)
 *        → byte[] container
 * </pre>
 */
package com.questrail.svga.codec.impl;
