package com.teamchat.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 雪花 id 的 workerId/datacenterId。
 *
 * <p>多实例部署必须保证 workerId 不同，否则同一毫秒内可能生成重复 id（消息顺序也依赖它）。
 * 未显式配置时，从网关 instance-id 末尾的数字推导（chat-2 -&gt; workerId=1）。</p>
 */
@Slf4j
@Configuration
public class IdWorkerConfig {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)(?!.*\\d)");

    private final long datacenterId;
    private final long workerId;
    private final String instanceId;

    public IdWorkerConfig(@Value("${chat.id.datacenter-id:1}") long datacenterId,
                          @Value("${chat.id.worker-id:-1}") long workerId,
                          @Value("${chat.gateway.ws.instance-id:}") String instanceId) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
        this.instanceId = instanceId;
    }

    @PostConstruct
    public void init() {
        long[] ids = resolve(workerId, datacenterId, instanceId);
        if (ids == null) {
            log.info("IdWorker: keep default sequence (no chat.id.worker-id, instanceId={})", instanceId);
            return;
        }
        IdWorker.initSequence(ids[0], ids[1]);
        log.info("IdWorker: workerId={}, datacenterId={}, instanceId={}", ids[0], ids[1], instanceId);
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        long[] ids = resolve(workerId, datacenterId, instanceId);
        return ids == null ? DefaultIdentifierGenerator.getInstance() : new DefaultIdentifierGenerator(ids[0], ids[1]);
    }

    /**
     * @return {workerId, datacenterId}；无法确定 workerId 时返回 null
     */
    static long[] resolve(long workerId, long datacenterId, String instanceId) {
        long wid = workerId >= 0 ? workerId : workerIdFromInstance(instanceId);
        if (wid < 0) {
            return null;
        }
        return new long[]{fiveBits(wid), fiveBits(datacenterId)};
    }

    private static long workerIdFromInstance(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return -1;
        }
        Matcher m = TRAILING_NUMBER.matcher(instanceId);
        if (!m.find()) {
            return -1;
        }
        try {
            return Long.parseLong(m.group(1)) - 1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static long fiveBits(long v) {
        return Math.floorMod(v, 32L);
    }
}
