package dev.newsroom;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NewsroomAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsroomAdminApplication.class, args);
    }
}
