package org.powerchart.chart;

import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.chart.LineChart;
import javafx.scene.chart.NumberAxis;
import javafx.scene.chart.XYChart;
import javafx.scene.control.Label;
import javafx.scene.control.Tooltip;
import javafx.scene.layout.StackPane;
import javafx.scene.layout.VBox;
import javafx.util.StringConverter;
import org.powerchart.model.AggregationResult;
import org.powerchart.model.Request;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the power chart and its annotations for an aggregation result.
 */
public class ChartFactory {

    public static final String AVERAGE_SERIES = "average";
    public static final String MAXIMUM_SERIES = "maximum";

    private static final DateTimeFormatter RANGE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public LineChart<Number, Number> createChart(Request request, AggregationResult result) {
        List<String> labels = windowLabels(result);
        List<String> visible = TickLabelPolicy.visibleLabels(labels, request.numDays(), request.windowCount());

        NumberAxis xAxis = new NumberAxis(0, Math.max(labels.size() - 1, 1), 1);
        xAxis.setLabel("Time");
        xAxis.setAutoRanging(false);
        xAxis.setMinorTickVisible(false);
        xAxis.setTickLabelRotation(-45);
        xAxis.setTickLabelFormatter(new StringConverter<>() {
            @Override
            public String toString(Number object) {
                int index = object.intValue();
                if (index != object.doubleValue() || index < 0 || index >= visible.size()) {
                    return "";
                }
                return visible.get(index);
            }

            @Override
            public Number fromString(String string) {
                return labels.indexOf(string);
            }
        });

        NumberAxis yAxis = new NumberAxis();
        yAxis.setLabel("Power usage (kW)");
        yAxis.setForceZeroInRange(false);

        LineChart<Number, Number> chart = new LineChart<>(xAxis, yAxis);
        chart.setAnimated(false);
        chart.setLegendVisible(true);
        chart.setCreateSymbols(true);
        chart.setTitle(request.title());
        chart.setPadding(new Insets(10));

        if (request.mode().includesAverage()) {
            chart.getData().add(buildSeries(AVERAGE_SERIES, result.getAverages(), request.plotClean()));
        }
        if (request.mode().includesMaximum()) {
            chart.getData().add(buildSeries(MAXIMUM_SERIES, result.getMaxima(), request.plotClean()));
        }
        return chart;
    }

    /**
     * Range line, cumulative statistics and disclaimers shown under the chart.
     */
    public VBox createAnnotations(Request request, AggregationResult result) {
        VBox box = new VBox(4);
        box.setAlignment(Pos.CENTER);
        box.setPadding(new Insets(6, 10, 10, 10));
        box.getChildren().add(new Label("Data from " + RANGE_FORMATTER.format(request.start())
                + " to " + RANGE_FORMATTER.format(request.end())));
        box.getChildren().add(new Label(result.summary()));
        for (String disclaimer : result.getDisclaimers()) {
            Label label = new Label(disclaimer);
            label.setStyle("-fx-text-fill: red;");
            box.getChildren().add(label);
        }
        return box;
    }

    static List<String> windowLabels(AggregationResult result) {
        return new ArrayList<>(result.getAverages().isEmpty()
                ? result.getMaxima().keySet()
                : result.getAverages().keySet());
    }

    private static XYChart.Series<Number, Number> buildSeries(String name, Map<String, Double> values, boolean clean) {
        XYChart.Series<Number, Number> series = new XYChart.Series<>();
        series.setName(name);
        int index = 0;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            XYChart.Data<Number, Number> point = new XYChart.Data<>(index++, entry.getValue());
            point.setExtraValue(entry.getKey());
            if (!clean) {
                point.setNode(valueNode(entry.getKey(), entry.getValue()));
            }
            series.getData().add(point);
        }
        return series;
    }

    private static StackPane valueNode(String label, double value) {
        String text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        Label valueLabel = new Label(text);
        valueLabel.setStyle("-fx-font-size: 9px;");
        valueLabel.setTranslateY(-12);
        StackPane node = new StackPane(valueLabel);
        node.setPrefSize(6, 6);
        node.setStyle("-fx-background-color: -fx-text-base-color; -fx-background-radius: 3;");
        Tooltip.install(node, new Tooltip(label + ": " + text + " kW"));
        return node;
    }
}
