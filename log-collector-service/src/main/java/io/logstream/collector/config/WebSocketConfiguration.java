package io.logstream.collector.config;

import io.logstream.collector.app.LogStreamWebSocketHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.embedded.tomcat.TomcatServletWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers {@code /ws} and opens the HTTP surfaces to browser clients on any origin.
 * <p>
 * Tomcat caps text frames at 8 KiB by default, which batched ingest frames exceed quickly, so the
 * buffer is raised to {@code logstream.websocket.max-text-message-bytes}.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfiguration implements WebSocketConfigurer, WebMvcConfigurer {

  private static final Logger log = LoggerFactory.getLogger(WebSocketConfiguration.class);
  private static final String TEXT_BUFFER_SIZE_PARAM = "org.apache.tomcat.websocket.textBufferSize";

  private final LogStreamWebSocketHandler handler;
  private final int maxTextMessageBytes;

  public WebSocketConfiguration(
      LogStreamWebSocketHandler handler,
      @Value("${logstream.websocket.max-text-message-bytes:1048576}") int maxTextMessageBytes) {
    this.handler = handler;
    this.maxTextMessageBytes = maxTextMessageBytes;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(handler, "/ws").setAllowedOrigins("*");
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry.addMapping("/**").allowedOrigins("*").allowedMethods("*").allowedHeaders("*");
  }

  @Bean
  WebServerFactoryCustomizer<TomcatServletWebServerFactory> webSocketBufferCustomizer() {
    return factory -> factory.addContextCustomizers(context -> {
      context.addParameter(TEXT_BUFFER_SIZE_PARAM, Integer.toString(maxTextMessageBytes));
      log.debug("Applied {}={}", TEXT_BUFFER_SIZE_PARAM, maxTextMessageBytes);
    });
  }
}
