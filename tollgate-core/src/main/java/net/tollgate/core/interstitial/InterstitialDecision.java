package net.tollgate.core.interstitial;

import java.util.Map;

public sealed interface InterstitialDecision permits InterstitialDecision.Proceed, InterstitialDecision.Redirect {

    /** 다음 핸들러로. query는 bypass 파라미터가 제거된 값 */
    record Proceed(String query) implements InterstitialDecision {}

    /** 303 See Other */
    record Redirect(String location, Map<String, String> headers) implements InterstitialDecision {
        public static final int STATUS = 303;

        public Redirect {
            headers = Map.copyOf(headers);
        }
    }
}
