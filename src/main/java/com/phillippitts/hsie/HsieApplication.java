package com.phillippitts.hsie;

import com.phillippitts.hsie.config.analysis.AnalysisProperties;
import com.phillippitts.hsie.config.analysis.WeightingProperties;
import com.phillippitts.hsie.config.preprocessing.DiarizationProperties;
import com.phillippitts.hsie.config.preprocessing.PreprocessingProperties;
import com.phillippitts.hsie.config.store.StoreProperties;
import com.phillippitts.hsie.config.transcription.TranscriptionProperties;
import com.phillippitts.hsie.config.transcription.WhisperConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@EnableConfigurationProperties({
        WhisperConfig.class,
        TranscriptionProperties.class,
        PreprocessingProperties.class,
        DiarizationProperties.class,
        AnalysisProperties.class,
        WeightingProperties.class,
        StoreProperties.class
})
public class HsieApplication {

    /**
     * With a command ({@code hsie run interview.wav}) the application runs it without a web server
     * and exits with the command's exit code; without one it serves the REST API.
     */
    public static void main(String[] args) {
        if (hasCommand(args)) {
            ConfigurableApplicationContext ctx = new SpringApplicationBuilder(HsieApplication.class)
                    .web(WebApplicationType.NONE)
                    .run(args);
            System.exit(SpringApplication.exit(ctx));
        }
        SpringApplication.run(HsieApplication.class, args);
    }

    static boolean hasCommand(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return true;
            }
        }
        return false;
    }
}
