package com.chesscoach.analysisservice.platform.ws;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 客户端通过 /ws 端点连接 WebSocket，
 * 使用 /app 前缀发送分析请求、/topic 前缀订阅分析结果。
 *
 * 用途：
 *   - /app/... : 客户端发送（如 /app/analysis.game）
 *   - /topic/... : 服务端推送（如 /topic/analysis.{requestId}）
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    /**
     * 配置 TaskScheduler 用于 WebSocket 心跳。
     * 使用 setHeartbeatValue() 时必须提供 TaskScheduler；bean 名称与 Spring 自动配置区分开。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 注册 WebSocket STOMP 端点
     * ----------------------------------------
     * 前端连接地址：
     *   ws://localhost:8082/ws
     *   或 SockJS 备用: http://localhost:8082/ws
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*");
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }

    /**
     * 配置消息代理（Broker）路由规则
     * ----------------------------------------
     *   - enableSimpleBroker(): 内存消息代理，/topic 用于分析结果推送
     *   - setApplicationDestinationPrefixes(): 客户端发消息的前缀
     *   - setHeartbeatValue(): 心跳间隔（毫秒）[客户端发送间隔, 服务端发送间隔]
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[]{5000, 5000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
    }
}
