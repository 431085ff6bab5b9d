/**
 * Service layer.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.codec} - probability map text format</li>
 *   <li>{@code service.vault} - id-keyed audio artifacts on disk</li>
 *   <li>{@code service.store} - analysis and tag rows (JdbcTemplate)</li>
 *   <li>{@code service.persistence} - create/delete/update protocol over store and vault</li>
 *   <li>{@code service.recording} - recording session state machine and countdown</li>
 *   <li>{@code service.audio} - microphone capture and WAV output</li>
 *   <li>{@code service.inference} - hand-off to the external inference back end</li>
 * </ul>
 *
 * <p>Services throw domain exceptions, never HTTP ones, and take collaborators through
 * their constructors.
 */
package com.phillippitts.voiceanalysis.service;
