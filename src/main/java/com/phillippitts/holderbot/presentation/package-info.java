/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters;
 * business rules live in the service packages and domain exceptions are mapped to HTTP
 * statuses in one place.
 *
 * @see com.phillippitts.holderbot.presentation.controller
 * @see com.phillippitts.holderbot.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.holderbot.presentation;
