package net.tollgate.core.model;

/** 요청 처리 후 슬롯을 반납할 때의 결과 */
public enum ReleaseOutcome {
    SUCCESS,
    INSTANCE_BUSY,
    INSTANCE_ERROR,
    /** 빌려온 인스턴스를 한 번도 쓰지 않고 돌려줌 */
    UNUSED;

    public boolean blacklists() {
        return this == INSTANCE_BUSY || this == INSTANCE_ERROR;
    }
}
