package com.phillippitts.interviewengine.config;

import com.phillippitts.interviewengine.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for capability calls and asynchronous event listeners.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.capability.*},
 * {@code threadpool.event.*}).
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Bounded pool on which every speech-to-text, text generation, synthesis and hand-off call
     * runs, so the caller can wait with a timeout and cancel on session end.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A saturated pool fails the
     * submission at once; the invoker reports it as a capability failure and the turn degrades
     * to silence. Running the call on the turn thread would escape the per-call timeout.
     *
     * <p>MDC propagation: the submitting thread's ThreadContext (requestId, sessionId, userId) is
     * copied to the worker.
     */
    @Bean(name = "capabilityExecutor")
    public ThreadPoolTaskExecutor capabilityExecutor() {
        return buildExecutor(threadPoolProperties.getCapability(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Pool for {@code @Async("eventExecutor")} listeners such as transcript-sink forwarding.
     * Saturation falls back to {@link ThreadPoolExecutor.CallerRunsPolicy}, so no event is dropped.
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return buildExecutor(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                        RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext from the submitting thread to the worker and restores the
     * worker's previous context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
