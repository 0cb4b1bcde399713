package uz.greenwhite.deviceauth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeviceAuthApplication {

    public static void main(String[] args) {
        SpringApplication.run(DeviceAuthApplication.class, args);
    }
}
