package org.tpch;

/**
 * Marker interface for benchmark execution units.
 *
 * <p>Every unit runs on its own thread, owns its own replica sessions and
 * reports exactly one result onto a channel shared with whoever started it.
 * Implementations include:
 * <ul>
 *   <li>{@code QueryStream}: a power, throughput or refresh stream</li>
 *   <li>the refresh functions of a {@code RefreshPair}, one unit per replica</li>
 * </ul>
 */
public interface Workload extends Runnable {}
