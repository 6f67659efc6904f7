package com.yerin.readingq.application;

import com.yerin.readingq.domain.QueuedJob;

/**
 * 리딩 생성 등 실제 작업을 수행하는 쪽이 구현한다.
 * <p>
 * 정상 반환이면 ack, 예외면 재시도 정책에 따라 nack 또는 DLQ.
 * 재시도해도 소용없는 입력 오류는 {@link com.yerin.readingq.global.exception.WorkerException#invalidJobData} 로 던진다.
 */
public interface ReadingJobHandler {
    void handle(QueuedJob job) throws Exception;
}
