package com.yerin.readingq.application;

import com.yerin.readingq.domain.QueuedJob;
import lombok.extern.slf4j.Slf4j;

/**
 * 실제 핸들러 빈이 없을 때 쓰는 기본 구현. 작업을 로그로만 남긴다.
 */
@Slf4j
public class LoggingReadingJobHandler implements ReadingJobHandler {

    @Override
    public void handle(QueuedJob job) {
        log.info("[Handler.reading] jobId={}, attempts={}, cardCount={}, promptVersion={}",
                job.jobId(), job.attempts(), job.payload().cardCount(), job.payload().promptVersion());
    }
}
