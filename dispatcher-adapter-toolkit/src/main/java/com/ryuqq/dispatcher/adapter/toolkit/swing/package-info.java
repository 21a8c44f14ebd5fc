/**
 * Swing/AWT 이벤트 디스패치 스레드 어댑터.
 *
 * <p>특정 DCC 호스트가 없지만 데스크톱 GUI가 있는 환경에서 사용됩니다
 * (우선순위 {@code TOOLKIT}).</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.adapter.toolkit.swing;
