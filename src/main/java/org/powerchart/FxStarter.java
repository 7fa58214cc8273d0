package org.powerchart;

import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.stage.Stage;
import org.powerchart.chart.ChartFactory;
import org.powerchart.config.AppConfig;
import org.powerchart.controller.MainController;
import org.powerchart.request.RequestOptions;
import org.powerchart.request.RequestParseException;
import org.powerchart.request.RequestParser;
import org.powerchart.service.PowerPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;

public class FxStarter extends Application {

    private static final Logger log = LoggerFactory.getLogger(FxStarter.class);

    private MainController controller;

    @Override
    public void start(Stage stage) {
        RequestOptions options;
        try {
            options = new RequestParser().parse(getParameters().getRaw(), LocalDateTime.now());
        } catch (RequestParseException ex) {
            log.error("{}", ex.getMessage());
            System.err.print(RequestParser.USAGE);
            System.err.println("error: " + ex.getMessage());
            Platform.exit();
            return;
        }

        AppConfig config = AppConfig.load();
        controller = new MainController(new PowerPipeline(config), new ChartFactory(), options,
                config.getDefaultOutputFile());
        Scene scene = new Scene(controller.getView());
        stage.setTitle("Computing Center Power Chart");
        stage.setScene(scene);
        stage.show();
        controller.autoRun();
    }

    @Override
    public void stop() {
        if (controller != null) {
            controller.shutdown();
        }
    }

    public static void main(String[] args) {
        launch(args);
    }
}
