package net.tollgate.core.responder;

import net.tollgate.core.model.ServiceInstance;

/** 스케줄러가 보고한 healthy 인스턴스 중 이 라우터가 슬롯을 관리할 것을 고른다. */
@FunctionalInterface
public interface InstanceOwnership {
    boolean ownedLocally(ServiceInstance instance);

    static InstanceOwnership all() {
        return instance -> true;
    }
}
