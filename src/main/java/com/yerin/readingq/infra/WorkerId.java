package com.yerin.readingq.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class WorkerId {
    private WorkerId() {}

    /** 컨슈머 그룹 안에서 유일한 컨슈머 이름: host-uuid8-index */
    public static String consumerName(int index) {
        String shortId = UUID.randomUUID().toString().substring(0, 8);
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + shortId + "-" + index;
        } catch (UnknownHostException e) {
            return "worker-" + shortId + "-" + index;
        }
    }
}
