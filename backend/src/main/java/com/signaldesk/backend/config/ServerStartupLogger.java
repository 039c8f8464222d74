package com.signaldesk.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ServerStartupLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final Environment environment;
    private final SignalDeskProperties properties;

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        int port = event.getWebServer().getPort();
        String contextPath = environment.getProperty("server.servlet.context-path", "");
        log.info("🚀 Signal Desk started on port {} (http://localhost:{}{})", port, port, contextPath);
        log.info("⚙️ Symbols: {} | manual approval: {} | approval timeout: {}ms | scheduler: {}",
                properties.getSymbols().size(),
                properties.getApproval().isManualApproval(),
                properties.getApproval().getTimeoutMs(),
                properties.getScheduler().isEnabled() ? properties.getScheduler().getIntervalSeconds() + "s" : "off");
    }
}
