package com.yerin.readingq.controller;

import com.yerin.readingq.domain.JobQueuePort;
import com.yerin.readingq.domain.JobStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin/queue")
@RequiredArgsConstructor
public class AdminQueueController {

    private final JobQueuePort jobQueuePort;

    @Value("${readingq.queue.backend:inmemory}")
    private String backend;

    @GetMapping
    public Map<String, Object> queue() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("backend", backend);
        out.put("pending", jobQueuePort.queueLength());
        out.put("dead_letters", jobQueuePort.deadLetterLength());
        out.put("ts", Instant.now().toString());
        return out;
    }

    @GetMapping("/jobs/{jobId}")
    public Map<String, Object> status(@PathVariable String jobId) {
        // 상태를 추적하지 않는 백엔드는 UNTRACKED
        String status = jobQueuePort.statusOf(jobId).map(JobStatus::name).orElse("UNTRACKED");
        return Map.of("job_id", jobId, "status", status);
    }
}
