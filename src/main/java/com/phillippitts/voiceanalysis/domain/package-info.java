/**
 * Domain model for voice analyses.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@link com.phillippitts.voiceanalysis.domain.AnalysisRecord} - one stored voice sample
 *       with its prediction channels</li>
 *   <li>{@link com.phillippitts.voiceanalysis.domain.ChannelPrediction} - label-to-confidence
 *       map plus feedback for one channel</li>
 *   <li>{@link com.phillippitts.voiceanalysis.domain.SendStatus} - inference lifecycle</li>
 * </ul>
 */
package com.phillippitts.voiceanalysis.domain;
