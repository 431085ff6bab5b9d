/**
 * REST surface over the persistence coordinator and recording sessions.
 */
package com.phillippitts.voiceanalysis.presentation;
