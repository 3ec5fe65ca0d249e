package kr.courtside.sync.api.realtime;

import java.util.concurrent.CompletionStage;

/**
 * 비동기 구독 콜백. 반환된 stage가 실패하면 해당 구독의 오류 처리기로 보고된다.
 * {@code null}을 반환하면 동기 완료로 본다.
 */
@FunctionalInterface
public interface AsyncChangeCallback {

    CompletionStage<?> onChange(ChangeEvent event) throws Exception;

    static AsyncChangeCallback of(ChangeCallback callback) {
        return event -> {
            callback.onChange(event);
            return null;
        };
    }
}
