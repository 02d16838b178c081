/**
 * Run orchestration: phases a weekly check over every combination in
 * parallel and assembles the
 * {@link com.volumesentinel.core.model.MonitoringResult}.
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.orchestration;
