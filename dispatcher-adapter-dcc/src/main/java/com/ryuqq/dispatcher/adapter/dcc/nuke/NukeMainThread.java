package com.ryuqq.dispatcher.adapter.dcc.nuke;

import com.ryuqq.dispatcher.adapter.dcc.HostBinding;

import java.util.concurrent.Callable;

/**
 * Nuke 메인 스레드 실행기 바인딩 포트.
 *
 * <p>{@code nuke.executeInMainThread} / {@code nuke.executeInMainThreadWithResult}에 대응합니다.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public interface NukeMainThread extends HostBinding {

    void executeInMainThread(Runnable task);

    <T> T executeInMainThreadWithResult(Callable<T> task) throws Exception;
}
