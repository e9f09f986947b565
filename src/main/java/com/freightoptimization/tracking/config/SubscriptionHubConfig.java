package com.freightoptimization.tracking.config;

import com.freightoptimization.tracking.cache.PositionCache;
import com.freightoptimization.tracking.push.PushMessageCodec;
import com.freightoptimization.tracking.push.PushTransport;
import com.freightoptimization.tracking.push.SubscriptionHub;
import com.freightoptimization.tracking.push.WebSocketPushTransport;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
public class SubscriptionHubConfig {

    @Bean
    @ConditionalOnMissingBean(PushTransport.class)
    public PushTransport pushTransport(TrackingProperties properties) {
        return new WebSocketPushTransport(new StandardWebSocketClient(), properties.getPush().getUrl());
    }

    /** Single thread: inbound frames and transport callbacks are handled in order. */
    @Bean("pushEventLoop")
    public Executor pushEventLoop() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("push-event-loop-");
        executor.initialize();
        return executor;
    }

    @Bean("pushReconnectScheduler")
    public ThreadPoolTaskScheduler pushReconnectScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("push-reconnect-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public SubscriptionHub subscriptionHub(PushTransport pushTransport, PushMessageCodec codec,
                                           PositionCache positionCache,
                                           @Qualifier("pushReconnectScheduler") TaskScheduler taskScheduler,
                                           @Qualifier("pushEventLoop") Executor pushEventLoop,
                                           Clock clock, TrackingProperties properties) {
        return new SubscriptionHub(pushTransport, codec, positionCache, taskScheduler, pushEventLoop,
                clock, properties.getPush());
    }
}
