package net.tollgate.core.description;

import net.tollgate.core.model.ServiceDescription;

@FunctionalInterface
public interface ServiceDescriptionLookup {
    /** 저장소에 없으면 기본값으로 채운 설명을 돌려준다 */
    ServiceDescription describe(String serviceId);
}
