package com.commutewise.commute_engine.service;

/**
 * 외부 지도 API 응답을 사용할 수 없을 때 게이트웨이 내부에서만 쓰는 예외.
 * 게이트웨이 경계 밖으로 나가지 않고 대체 데이터나 빈 결과로 바뀐다.
 */
public class GatewayUnavailableException extends RuntimeException {

    public GatewayUnavailableException(String message) {
        super(message);
    }

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
