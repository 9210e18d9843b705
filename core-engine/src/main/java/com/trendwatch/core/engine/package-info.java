/**
 * Cycle coordination: extraction, rendering and commit per subsystem.
 *
 * <p>
 * {@link com.trendwatch.core.engine.TrendCycleRunner} runs one cycle on one
 * registry; {@link com.trendwatch.core.engine.TrendingEngine} keeps one
 * registry per subsystem, serialises cycles of a subsystem and runs
 * different subsystems concurrently.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendwatch.core.engine;
