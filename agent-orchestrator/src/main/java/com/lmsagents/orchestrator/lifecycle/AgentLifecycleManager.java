package com.lmsagents.orchestrator.lifecycle;

import com.lmsagents.adaptation.AdaptationWorker;
import com.lmsagents.common.persistence.PersistenceGateway;
import com.lmsagents.common.worker.Agent;
import com.lmsagents.monitoring.MonitoringWorker;
import com.lmsagents.notification.NotificationWorker;
import com.lmsagents.orchestrator.router.OrchestratorRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts the router before any worker can address it, and stops everything in reverse
 * order once the web server has stopped taking requests.
 */
@Component
public class AgentLifecycleManager implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycleManager.class);

    private final List<Agent> startOrder;
    private final PersistenceGateway gateway;
    private final boolean autoStartup;
    private volatile boolean running;

    public AgentLifecycleManager(OrchestratorRouter router,
                                 NotificationWorker notificationWorker,
                                 AdaptationWorker adaptationWorker,
                                 MonitoringWorker monitoringWorker,
                                 PersistenceGateway gateway,
                                 @Value("${lms.agents.autostart:true}") boolean autoStartup) {
        this.startOrder  = List.of(router, notificationWorker, adaptationWorker, monitoringWorker);
        this.gateway     = gateway;
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        for (Agent agent : startOrder) {
            agent.start();
            log.info("[Lifecycle] Started {}", agent.agentName());
        }
        running = true;
    }

    @Override
    public void stop() {
        for (int i = startOrder.size() - 1; i >= 0; i--) {
            Agent agent = startOrder.get(i);
            try {
                agent.stop();
                log.info("[Lifecycle] Stopped {}", agent.agentName());
            } catch (RuntimeException e) {
                log.error("[Lifecycle] Failed to stop {}", agent.agentName(), e);
            }
        }
        try {
            gateway.close();
        } catch (RuntimeException e) {
            log.error("[Lifecycle] Failed to close persistence gateway", e);
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }

    List<Agent> startOrder() {
        return startOrder;
    }
}
