package com.example.qrattendance.exception;

public class UnknownStudentException extends RuntimeException {

    public UnknownStudentException(String message) {
        super(message);
    }
}
