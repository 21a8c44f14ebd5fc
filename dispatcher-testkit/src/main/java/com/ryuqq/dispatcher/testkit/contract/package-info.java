/**
 * Backend contract tests shared by every adapter module.
 *
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.testkit.contract;
