package com.teamchat.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties({
        ChatDbExecutorProperties.class,
        ChatNotifyExecutorProperties.class
})
public class ChatExecutorsConfig {

    @Bean("chatDbExecutor")
    @Primary
    public Executor chatDbExecutor(ChatDbExecutorProperties props) {
        return build("chat-db-", props.corePoolSizeEffective(), props.maxPoolSizeEffective(),
                props.queueCapacityEffective(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * 离线通知：满了直接丢弃（DiscardPolicy），不反压发送链路。
     */
    @Bean("chatNotifyExecutor")
    public Executor chatNotifyExecutor(ChatNotifyExecutorProperties props) {
        return build("chat-notify-", props.corePoolSizeEffective(), props.maxPoolSizeEffective(),
                props.queueCapacityEffective(), new ThreadPoolExecutor.DiscardPolicy());
    }

    private static Executor build(String prefix, int core, int max, int queue,
                                  RejectedExecutionHandler rejected) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(Math.max(core, max));
        executor.setQueueCapacity(queue);
        executor.setRejectedExecutionHandler(rejected);
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
