package com.jobflow.core;

/**
 * How a {@link JobRegistry} reaches queues.
 *
 * <ul>
 *   <li>UNINITIALIZED → RESOLVER_INSTALLED: a worker runtime installed its resolver</li>
 *   <li>UNINITIALIZED → EXTERNAL_CACHE_IN_USE: a caller-only process triggered a job</li>
 *   <li>EXTERNAL_CACHE_IN_USE → RESOLVER_INSTALLED: cached handles are closed first</li>
 *   <li>EXTERNAL_CACHE_IN_USE → UNINITIALIZED: {@link JobRegistry#closeExternalQueues()}</li>
 * </ul>
 */
public enum ResolutionMode {
    UNINITIALIZED,
    RESOLVER_INSTALLED,
    EXTERNAL_CACHE_IN_USE
}
