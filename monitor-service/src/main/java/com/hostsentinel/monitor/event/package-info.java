/**
 * Engine event stream consumed by the presentation layer.
 *
 * @since 1.0.0
 */
package com.hostsentinel.monitor.event;
