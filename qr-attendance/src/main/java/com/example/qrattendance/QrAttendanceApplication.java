package com.example.qrattendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QrAttendanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(QrAttendanceApplication.class, args);
    }

}
