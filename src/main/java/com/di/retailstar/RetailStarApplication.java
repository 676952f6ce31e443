package com.di.retailstar;

import com.di.retailstar.config.RetailStarProperties;
import com.di.retailstar.runner.PipelineRunResult;
import com.di.retailstar.runner.PipelineRunnerService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties(RetailStarProperties.class)
public class RetailStarApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(RetailStarApplication.class, args);
		RetailStarProperties props = ctx.getBean(RetailStarProperties.class);
		// Without an input file the application only starts; runs are triggered through PipelineRunnerService.
		if (props.isRunOnStartup() && props.hasInputFile()) {
			PipelineRunResult result = ctx.getBean(PipelineRunnerService.class).run((String) null);
			if (!result.isSuccess()) {
				System.exit(SpringApplication.exit(ctx, () -> 1));
			}
		}
	}
}
