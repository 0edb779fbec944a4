package net.tollgate.core.model;

/**
 * 백엔드 프로세스 하나. 불변이며, 헬스가 바뀌면 스케줄러가 같은 id로 새 레코드를 보낸다.
 */
public record ServiceInstance(
        String id,
        String serviceId,
        String host,
        int port,
        String logDirectory   // optional
) {
    public static ServiceInstance of(String id, String serviceId, String host, int port) {
        return new ServiceInstance(id, serviceId, host, port, null);
    }

    /** id/serviceId/host가 비어있지 않고 port가 유효한지 */
    public boolean wellFormed() {
        return id != null && !id.isBlank()
                && serviceId != null && !serviceId.isBlank()
                && host != null && !host.isBlank()
                && port > 0 && port <= 65535;
    }
}
