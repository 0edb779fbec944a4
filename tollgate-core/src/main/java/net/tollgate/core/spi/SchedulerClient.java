package net.tollgate.core.spi;

import net.tollgate.core.model.SchedulerSnapshot;
import net.tollgate.core.model.ServiceInstance;

/** 외부 스케줄러(오케스트레이터) 드라이버. 재시도는 구현체 책임. */
public interface SchedulerClient {
    SchedulerSnapshot fetchState() throws Exception;

    /** reason=killed 블랙리스트 성공 후 통지 */
    default void instanceKilled(ServiceInstance instance) throws Exception { }
}
