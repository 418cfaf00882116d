package com.example.qrattendance.service;

import com.example.qrattendance.entity.AttendanceOutcome;

/**
 * 지각/결석 알림 수신자. 호출은 best-effort 이며 실패가 체크인 결과에 영향을 주지 않는다.
 */
public interface LateArrivalNotifier {

    void notifyLateOrAbsent(AttendanceOutcome outcome);
}
