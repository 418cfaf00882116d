package com.example.qrattendance.entity;

import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class QrTokenKey {

    @NonNull String classId;
    @NonNull LocalDate date;

    @Override
    public String toString() {
        return classId + ":" + date;
    }
}
