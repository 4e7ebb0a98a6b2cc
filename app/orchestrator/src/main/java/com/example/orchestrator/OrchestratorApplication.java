/*
 * どこで: Orchestrator アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: ジョブスケジューラと通知ディスパッチャを単一プロセスで起動するため
 */
package com.example.orchestrator;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class OrchestratorApplication {

	public static void main(String[] args) {
		SpringApplication.run(OrchestratorApplication.class, args);
	}
}
