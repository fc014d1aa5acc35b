package com.dealflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "dealflow.supervisor")
public class SupervisorProperties {

    /** Minimum confidence a rule's decision needs to be returned as-is. */
    private double confidenceThreshold = 0.8;

    /** Pipelines with fewer deals than this are topped up by the scout. */
    private int lowWaterMark = 5;

    /** How long a deal may sit in an in-flight status before it counts as stalled. */
    private Duration stallThreshold = Duration.ofMinutes(5);

    private List<String> inFlightStatuses = List.of("analyzing");

    /** Agent messages at or above this priority count as errors. */
    private int errorMessagePriority = 4;

    /** Number of most recent decisions inspected for routing recommendations. */
    private int recommendationWindow = 6;

    /** Selections of the same agent within the window that trigger a recommendation. */
    private int recommendationThreshold = 5;

    private int historyCapacity = 500;

    /** Events kept per workflow in the supervisor's event log. */
    private int eventLogCapacity = 100;

    /** Workflows whose event logs are kept; the least recently active is dropped first. */
    private int eventLogWorkflows = 200;

    /** Arbitration priority per agent; higher wins a contended resource. */
    private Map<String, Integer> agentPriorities = new LinkedHashMap<>(Map.of(
            "analyst", 90,
            "negotiator", 80,
            "contract", 70,
            "scout", 60,
            "portfolio", 50));

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public int getLowWaterMark() {
        return lowWaterMark;
    }

    public void setLowWaterMark(int lowWaterMark) {
        this.lowWaterMark = lowWaterMark;
    }

    public Duration getStallThreshold() {
        return stallThreshold;
    }

    public void setStallThreshold(Duration stallThreshold) {
        this.stallThreshold = stallThreshold;
    }

    public List<String> getInFlightStatuses() {
        return inFlightStatuses;
    }

    public void setInFlightStatuses(List<String> inFlightStatuses) {
        this.inFlightStatuses = inFlightStatuses;
    }

    public int getErrorMessagePriority() {
        return errorMessagePriority;
    }

    public void setErrorMessagePriority(int errorMessagePriority) {
        this.errorMessagePriority = errorMessagePriority;
    }

    public int getRecommendationWindow() {
        return recommendationWindow;
    }

    public void setRecommendationWindow(int recommendationWindow) {
        this.recommendationWindow = recommendationWindow;
    }

    public int getRecommendationThreshold() {
        return recommendationThreshold;
    }

    public void setRecommendationThreshold(int recommendationThreshold) {
        this.recommendationThreshold = recommendationThreshold;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getEventLogCapacity() {
        return eventLogCapacity;
    }

    public void setEventLogCapacity(int eventLogCapacity) {
        this.eventLogCapacity = eventLogCapacity;
    }

    public int getEventLogWorkflows() {
        return eventLogWorkflows;
    }

    public void setEventLogWorkflows(int eventLogWorkflows) {
        this.eventLogWorkflows = eventLogWorkflows;
    }

    public Map<String, Integer> getAgentPriorities() {
        return agentPriorities;
    }

    public void setAgentPriorities(Map<String, Integer> agentPriorities) {
        this.agentPriorities = agentPriorities;
    }

    public int agentPriority(String agent) {
        return agentPriorities.getOrDefault(agent, 0);
    }
}
