package org.powerchart.controller;

import javafx.concurrent.Task;
import javafx.embed.swing.SwingFXUtils;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.chart.LineChart;
import javafx.scene.control.*;
import javafx.scene.image.WritableImage;
import javafx.scene.layout.*;
import javafx.stage.FileChooser;
import javafx.stage.Window;
import org.powerchart.chart.ChartFactory;
import org.powerchart.model.AggregationResult;
import org.powerchart.model.ChannelCatalog;
import org.powerchart.model.MainRoomView;
import org.powerchart.model.MetricMode;
import org.powerchart.model.Request;
import org.powerchart.request.RequestOptions;
import org.powerchart.service.PowerPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Request form, chart area and status bar. Pipeline runs happen on a single background worker.
 */
public class MainController {

    private static final Logger log = LoggerFactory.getLogger(MainController.class);

    private final PowerPipeline pipeline;
    private final ChartFactory chartFactory;
    private final RequestOptions options;
    private final Path defaultOutput;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "power-pipeline");
        thread.setDaemon(true);
        return thread;
    });

    private final BorderPane root = new BorderPane();
    private final BorderPane chartPane = new BorderPane();
    private final Label statusLabel = new Label("No chart built");
    private final ComboBox<ChannelCatalog.Category> categoryBox = new ComboBox<>();
    private final ComboBox<String> groupBox = new ComboBox<>();
    private final ComboBox<MainRoomView> viewBox = new ComboBox<>();
    private final DatePicker startPicker = new DatePicker();
    private final DatePicker endPicker = new DatePicker();
    private final Spinner<Integer> pointsSpinner = new Spinner<>(1, 10_000, 50);
    private final ComboBox<MetricMode> modeBox = new ComboBox<>();
    private final CheckBox cleanBox = new CheckBox("Clean");
    private final Button buildButton = new Button("Build chart");
    private final Button exportButton = new Button("Export PNG");
    private final ProgressIndicator progressIndicator = new ProgressIndicator();

    private LineChart<Number, Number> currentChart;

    public MainController(PowerPipeline pipeline, ChartFactory chartFactory, RequestOptions options, Path defaultOutput) {
        this.pipeline = pipeline;
        this.chartFactory = chartFactory;
        this.options = options;
        this.defaultOutput = defaultOutput;
        configureLayout();
        attachListeners();
        prefill();
    }

    public Pane getView() {
        return root;
    }

    /**
     * Builds the chart right away when the command line named a group.
     */
    public void autoRun() {
        if (options.isComplete()) {
            build();
        }
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private void configureLayout() {
        root.setPrefSize(1280, 800);
        root.setTop(buildToolbar());

        chartPane.setPadding(new Insets(16));
        progressIndicator.setVisible(false);
        progressIndicator.setMaxSize(60, 60);
        StackPane overlay = new StackPane(chartPane, progressIndicator);
        StackPane.setAlignment(progressIndicator, Pos.CENTER);
        root.setCenter(overlay);

        HBox statusBar = new HBox(statusLabel);
        statusBar.setAlignment(Pos.CENTER_LEFT);
        statusBar.setPadding(new Insets(6, 10, 6, 10));
        statusBar.setStyle("-fx-background-color: #f4f4f4; -fx-border-color: #dcdcdc; -fx-border-width: 1 0 0 0;");
        root.setBottom(statusBar);
    }

    private ToolBar buildToolbar() {
        categoryBox.getItems().setAll(ChannelCatalog.Category.values());
        viewBox.getItems().setAll(MainRoomView.values());
        modeBox.getItems().setAll(MetricMode.values());
        groupBox.setPrefWidth(220);
        pointsSpinner.setEditable(true);
        pointsSpinner.setPrefWidth(90);
        buildButton.setDefaultButton(true);
        exportButton.setDisable(true);

        ToolBar toolBar = new ToolBar();
        toolBar.getItems().addAll(
                new Label("Category:"), categoryBox,
                new Label("Group:"), groupBox,
                new Label("View:"), viewBox,
                new Separator(),
                new Label("From:"), startPicker,
                new Label("To:"), endPicker,
                new Label("Points:"), pointsSpinner,
                modeBox,
                cleanBox,
                new Separator(),
                buildButton,
                exportButton
        );
        toolBar.setPadding(new Insets(6));
        toolBar.setStyle("-fx-background-color: #fafafa;");
        return toolBar;
    }

    private void attachListeners() {
        categoryBox.valueProperty().addListener((obs, oldValue, category) -> {
            groupBox.getItems().setAll(category == null ? List.of() : category.getChannels());
            groupBox.getSelectionModel().selectFirst();
        });
        groupBox.valueProperty().addListener((obs, oldValue, group) ->
                viewBox.setDisable(!ChannelCatalog.isMainRoom(group)));
        buildButton.setOnAction(e -> build());
        exportButton.setOnAction(e -> chooseAndExport());
    }

    private void prefill() {
        options.groupOption().ifPresentOrElse(group -> {
            categoryBox.setValue(categoryOf(group).orElse(ChannelCatalog.Category.FACILITY_AGGREGATES));
            groupBox.setValue(group);
        }, () -> categoryBox.setValue(ChannelCatalog.Category.FACILITY_AGGREGATES));
        viewBox.setValue(options.viewOption().orElse(MainRoomView.WHOLE));
        startPicker.setValue(options.start().toLocalDate());
        endPicker.setValue(options.end().toLocalDate());
        pointsSpinner.getValueFactory().setValue(options.points());
        modeBox.setValue(options.mode());
        cleanBox.setSelected(options.plotClean());
    }

    private void build() {
        Request request;
        try {
            request = requestFromForm();
        } catch (IllegalArgumentException ex) {
            showError("Invalid request", ex);
            return;
        }

        toggleLoading(true);
        Task<AggregationResult> task = new Task<>() {
            @Override
            protected AggregationResult call() throws Exception {
                updateMessage("Building chart for " + request.group() + "...");
                return pipeline.run(request);
            }
        };

        statusLabel.textProperty().bind(task.messageProperty());
        task.setOnSucceeded(event -> {
            statusLabel.textProperty().unbind();
            toggleLoading(false);
            showChart(request, task.getValue());
        });
        task.setOnFailed(event -> {
            statusLabel.textProperty().unbind();
            toggleLoading(false);
            Throwable ex = task.getException();
            log.error("Chart request failed", ex);
            chartPane.setCenter(null);
            chartPane.setBottom(null);
            currentChart = null;
            exportButton.setDisable(true);
            statusLabel.setText("Chart request failed");
            showError("Could not build the chart", ex);
        });
        executor.submit(task);
    }

    private Request requestFromForm() {
        String group = groupBox.getValue();
        if (group == null) {
            throw new IllegalArgumentException("Group name is not specified");
        }
        LocalDateTime start = dateTime(startPicker.getValue(), options.start());
        LocalDateTime end = dateTime(endPicker.getValue(), options.end());
        MetricMode mode = modeBox.getValue() == null ? MetricMode.BOTH : modeBox.getValue();
        return new Request(group, viewBox.getValue(), start, end, pointsSpinner.getValue(), mode,
                cleanBox.isSelected(), options.output());
    }

    private void showChart(Request request, AggregationResult result) {
        currentChart = chartFactory.createChart(request, result);
        currentChart.setMinHeight(480);
        chartPane.setCenter(currentChart);
        chartPane.setBottom(chartFactory.createAnnotations(request, result));
        exportButton.setDisable(false);
        statusLabel.setText(request.title() + ": " + result.summary());
        request.outputFile().ifPresent(this::export);
    }

    private void chooseAndExport() {
        if (currentChart == null) {
            return;
        }
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Save chart");
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("PNG", "*.png"));
        chooser.setInitialFileName(defaultOutput.getFileName().toString());
        Optional.ofNullable(chooser.showSaveDialog(getWindow()))
                .map(File::toPath)
                .ifPresent(this::export);
    }

    private void export(Path target) {
        try {
            WritableImage image = chartPane.snapshot(null, null);
            ImageIO.write(SwingFXUtils.fromFXImage(image, null), "png", target.toFile());
            log.info("Chart written to {}", target.toAbsolutePath());
            statusLabel.setText("Saved to " + target.toAbsolutePath());
        } catch (IOException ex) {
            showError("Could not save the image", ex);
        }
    }

    private void toggleLoading(boolean loading) {
        progressIndicator.setVisible(loading);
        buildButton.setDisable(loading);
        exportButton.setDisable(loading || currentChart == null);
    }

    private void showError(String message, Throwable ex) {
        Alert alert = new Alert(Alert.AlertType.ERROR);
        alert.setTitle("Error");
        alert.setHeaderText(message);
        alert.setContentText(ex.getMessage());
        alert.showAndWait();
    }

    private static LocalDateTime dateTime(LocalDate picked, LocalDateTime fallback) {
        if (picked == null) {
            return fallback;
        }
        return picked.equals(fallback.toLocalDate()) ? fallback : picked.atStartOfDay();
    }

    private static Optional<ChannelCatalog.Category> categoryOf(String group) {
        return Arrays.stream(ChannelCatalog.Category.values())
                .filter(category -> category.getChannels().contains(group))
                .findFirst();
    }

    private Window getWindow() {
        Scene scene = root.getScene();
        return scene == null ? null : scene.getWindow();
    }
}
