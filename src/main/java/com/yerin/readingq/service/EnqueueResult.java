package com.yerin.readingq.service;

/**
 * @param duplicate dedupe_key 가 TTL 안에 이미 제출돼서 큐에 넣지 않았으면 true
 */
public record EnqueueResult(String jobId, boolean duplicate) {}
