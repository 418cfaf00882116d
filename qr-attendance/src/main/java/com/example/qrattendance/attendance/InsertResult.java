package com.example.qrattendance.attendance;

import com.example.qrattendance.entity.AttendanceOutcome;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InsertResult {

    boolean inserted;
    /** 이미 기록된 출석, inserted 가 false 일 때만 존재 */
    AttendanceOutcome existing;

    public static InsertResult inserted() {
        return new InsertResult(true, null);
    }

    public static InsertResult duplicate(AttendanceOutcome existing) {
        return new InsertResult(false, existing);
    }
}
