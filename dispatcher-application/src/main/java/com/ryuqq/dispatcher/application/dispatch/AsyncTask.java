package com.ryuqq.dispatcher.application.dispatch;

import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * 메인 스레드에서 끝까지 구동되는 비동기 작업.
 *
 * <p>{@code mainThread}는 메인 스레드에 고정된 실행기입니다. 작업의 모든 후속 단계를
 * 이 실행기로 이어 붙이면 전체 본문이 메인 스레드에서 실행됩니다.</p>
 *
 * <pre>{@code
 * AsyncTask<String> task = mainThread -> CompletableFuture
 *     .supplyAsync(() -> scene.selection(), mainThread)
 *     .thenApplyAsync(selection -> selection.first().name(), mainThread);
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Dispatcher Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AsyncTask<T> {

    /**
     * 작업 시작.
     *
     * @param mainThread 메인 스레드에 고정된 실행기
     * @return 작업 완료 단계
     * @throws Exception 시작 실패 시
     */
    CompletionStage<T> start(Executor mainThread) throws Exception;
}
