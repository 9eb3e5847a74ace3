package com.surveylauncher.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class BackendApplication {

	public static void main(String[] args) {
		// 권한 만료/캐시 TTL 계산이 모두 UTC 기준이므로 JVM 기본 타임존도 UTC로 고정한다.
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(BackendApplication.class, args);
	}

}

/*
루트 패키지에 두어야 global/modules 하위 컴포넌트가 모두 스캔된다.
 */
