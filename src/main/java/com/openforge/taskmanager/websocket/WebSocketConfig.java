package com.openforge.taskmanager.websocket;

import com.openforge.taskmanager.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.ChannelRegistration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Spring STOMP/WebSocket configuration.
 *
 * Frontend connection flow:
 *   1. Connect to  ws://host/ws  (or SockJS fallback: http://host/ws)
 *   2. STOMP CONNECT with header  Authorization: Bearer <token>
 *   3. STOMP SUBSCRIBE /user/queue/notifications
 *   4. Receive the caller's own in-app notification JSON frames
 *
 * The in-memory simple broker is sufficient for single-node deployments.
 */
@Configuration
@EnableWebSocketMessageBroker
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final AppProperties               appProperties;
    private final StompAuthChannelInterceptor authInterceptor;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/queue");
        registry.setApplicationDestinationPrefixes("/app");
        registry.setUserDestinationPrefix("/user");
    }

    @Override
    public void configureClientInboundChannel(ChannelRegistration registration) {
        registration.interceptors(authInterceptor);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(appProperties.corsOrigins().toArray(String[]::new))
                .withSockJS();
    }
}
