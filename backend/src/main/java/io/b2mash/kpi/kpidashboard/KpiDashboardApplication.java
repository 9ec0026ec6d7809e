package io.b2mash.kpi.kpidashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KpiDashboardApplication {

  public static void main(String[] args) {
    SpringApplication.run(KpiDashboardApplication.class, args);
  }
}
