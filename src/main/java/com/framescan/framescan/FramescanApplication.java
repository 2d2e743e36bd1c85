package com.framescan.framescan;

import org.bytedeco.ffmpeg.global.avutil;
import org.bytedeco.javacv.FFmpegLogCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.framescan.framescan.config.ScanProperties;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ScanProperties.class)
public class FramescanApplication {

	public static void main(String[] args) {
		// Route FFmpeg messages through the JavaCPP logger, errors only
		FFmpegLogCallback.set();
		avutil.av_log_set_level(avutil.AV_LOG_ERROR);

		SpringApplication.run(FramescanApplication.class, args);
	}

}
