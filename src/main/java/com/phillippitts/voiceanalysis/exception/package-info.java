/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.voiceanalysis.exception.VoiceAnalysisException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.voiceanalysis.exception.ValidationException} - Input rejected
 *       before any write</li>
 *   <li>{@link com.phillippitts.voiceanalysis.exception.StorageException} - Structured store
 *       failure</li>
 *   <li>{@link com.phillippitts.voiceanalysis.exception.FileStorageException} - File vault
 *       copy or delete failure</li>
 *   <li>{@link com.phillippitts.voiceanalysis.exception.AnalysisNotFoundException} - Unknown
 *       analysis id on a write path</li>
 *   <li>{@link com.phillippitts.voiceanalysis.exception.CaptureDeviceException} - Recoverable
 *       capture hardware failure</li>
 *   <li>{@link com.phillippitts.voiceanalysis.exception.InferenceException} - Inference
 *       collaborator failure</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining, and map to HTTP status codes via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.voiceanalysis.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voiceanalysis.exception;
