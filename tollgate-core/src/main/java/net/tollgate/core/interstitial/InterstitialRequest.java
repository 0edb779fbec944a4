package net.tollgate.core.interstitial;

/**
 * 필터가 보는 요청 정보.
 * @param uri       경로 (쿼리 제외)
 * @param query     쿼리 문자열, 없으면 null
 * @param accept    Accept 헤더
 * @param onTheFly  토큰 없이 헤더로 서비스를 지정한 요청
 */
public record InterstitialRequest(String serviceId, String uri, String query, String accept, boolean onTheFly) {}
