/**
 * OpenDRIVE Codec Boundary
 * =============================================================================
 *
 * <p>This package defines the public read and write boundary of the codec.
 * Implementations map between OpenDRIVE 1.7 XML and the semantic model in
 * {@code com.questrail.opendrive.model}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   bytes
 *     → OpenDriveReader  → Document → application code
 *     ← OpenDriveWriter  ← Document ←
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>The reader takes its {@code CompatibilityConfig} at construction. The
 *       writer takes none: every workaround only relaxes what the reader
 *       accepts, and the writer always produces strict output. Nothing in this
 *       package consults process-wide state.</li>
 *   <li>Element-level mapping rules live in {@code internal.decode} and
 *       {@code internal.encode}; nothing outside this package should use them
 *       directly.</li>
 * </ul>
 */
package com.questrail.opendrive.codec;
