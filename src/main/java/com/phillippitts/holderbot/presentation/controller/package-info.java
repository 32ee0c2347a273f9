/**
 * REST controllers.
 *
 * <ul>
 *   <li>{@link com.phillippitts.holderbot.presentation.controller.SubjectController}
 *       - decisions, stored records, corrections, learned predictions, export and import
 *       ({@code /api/subjects})</li>
 *   <li>{@link com.phillippitts.holderbot.presentation.controller.CalibrationController}
 *       - outcomes, bins, confusions, trend and report ({@code /api/calibration})</li>
 * </ul>
 */
package com.phillippitts.holderbot.presentation.controller;
