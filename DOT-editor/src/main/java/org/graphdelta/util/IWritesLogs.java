package org.graphdelta.util;

/** Marker for classes which write messages through the {@link Logger}. */
public interface IWritesLogs {}
