/**
 * Multi-window trend reporting.
 *
 * <p>
 * {@link com.volumesentinel.core.trend.TrendAnalyzer} summarises each
 * combination over the {@link com.volumesentinel.core.trend.TrendWindow}
 * menu and compares recent weeks with the full history.
 * </p>
 *
 * @since 1.0.0
 */
package com.volumesentinel.core.trend;
