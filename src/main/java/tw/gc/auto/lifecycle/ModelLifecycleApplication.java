package tw.gc.auto.lifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.TimeZone;

@SpringBootApplication
@EnableScheduling
public class ModelLifecycleApplication {

    static {
        // Scheduled evaluation cycles and audit timestamps share one zone
        TimeZone.setDefault(TimeZone.getTimeZone(AppConstants.SCHEDULER_TIMEZONE));
    }

    public static void main(String[] args) {
        SpringApplication.run(ModelLifecycleApplication.class, args);
    }
}
