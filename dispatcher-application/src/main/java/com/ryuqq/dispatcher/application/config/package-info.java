/**
 * 디스패처 설정.
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.config;
