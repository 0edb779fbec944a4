package net.tollgate.core.model;

public sealed interface InstanceSelection
        permits InstanceSelection.Selected, InstanceSelection.NoInstanceAvailable, InstanceSelection.QueueFull {

    String MAX_QUEUE_LENGTH_EXCEEDED = "Max queue length exceeded!";

    record Selected(ServiceInstance instance, boolean borrowed) implements InstanceSelection {}

    record NoInstanceAvailable(String serviceId) implements InstanceSelection {}

    record QueueFull(String serviceId, int maxQueueLength) implements InstanceSelection {
        public String message() {
            return MAX_QUEUE_LENGTH_EXCEEDED + " service-id=" + serviceId + ", max-queue-length=" + maxQueueLength;
        }
    }
}
