/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the capability contract that every host adapter implements.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.DispatcherBackend} - availability probe, deferred
 *       dispatch, blocking dispatch, main-thread test</li>
 *   <li>{@link com.ryuqq.dispatcher.core.spi.AbstractDispatcherBackend} - shared defaults and the
 *       scheduler + result holder construction for hosts without a native blocking call</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (dispatcher-adapter-dcc, dispatcher-adapter-toolkit) provide concrete
 * implementations. Third-party backends implement the same interface and are registered
 * through the application registry.</p>
 *
 * @since 1.0.0
 * @author Dispatcher Team
 */
package com.ryuqq.dispatcher.core.spi;
