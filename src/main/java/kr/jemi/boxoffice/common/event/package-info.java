/**
 * 좌석 상태 전이 이벤트. 선점/예매 모듈이 발행하고 브로드캐스트 모듈과 외부 알림 협력자가 구독한다.
 * 전달은 최선 노력이며 클라이언트는 재연결 시 좌석 배치도를 다시 조회해야 한다.
 */
@NamedInterface("event")
package kr.jemi.boxoffice.common.event;

import org.springframework.modulith.NamedInterface;
