package ch.xavier.crossover.visualization;

import ch.xavier.crossover.backtesting.model.BacktestResult;
import ch.xavier.crossover.backtesting.model.EquityPoint;
import lombok.extern.slf4j.Slf4j;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.Styler;
import org.knowm.xchart.style.markers.SeriesMarkers;
import org.springframework.stereotype.Service;

import java.awt.*;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

@Service
@Slf4j
public class EquityCurveChartExporter {

    public XYChart createEquityChart(BacktestResult result) {
        XYChart chart = new XYChartBuilder()
                .width(1000)
                .height(500)
                .title(result.getSymbol() + " - " + result.getStrategyName())
                .xAxisTitle("Time")
                .yAxisTitle("Account value")
                .build();

        chart.getStyler().setLegendPosition(Styler.LegendPosition.InsideNW);
        chart.getStyler().setDefaultSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Line);
        chart.getStyler().setDatePattern("yyyy-MM-dd");
        chart.getStyler().setXAxisTickMarkSpacingHint(100);

        List<EquityPoint> curve = result.getEquityCurve();
        if (curve == null || curve.isEmpty()) {
            return chart;
        }

        List<Date> xData = new ArrayList<>();
        List<Double> equity = new ArrayList<>();
        List<Double> balance = new ArrayList<>();
        for (EquityPoint point : curve) {
            xData.add(Date.from(point.getTimestamp()));
            equity.add(point.getEquity());
            balance.add(point.getBalance());
        }

        XYSeries equitySeries = chart.addSeries("Equity", xData, equity);
        equitySeries.setMarker(SeriesMarkers.NONE);
        equitySeries.setLineColor(Color.BLUE);

        XYSeries balanceSeries = chart.addSeries("Balance", xData, balance);
        balanceSeries.setMarker(SeriesMarkers.NONE);
        balanceSeries.setLineColor(Color.GRAY);

        return chart;
    }

    public XYChart createDrawdownChart(BacktestResult result) {
        XYChart chart = new XYChartBuilder()
                .width(1000)
                .height(300)
                .title(result.getSymbol() + " drawdown")
                .xAxisTitle("Time")
                .yAxisTitle("Drawdown %")
                .build();

        chart.getStyler().setLegendVisible(false);
        chart.getStyler().setDefaultSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Area);

        List<EquityPoint> curve = result.getEquityCurve();
        if (curve == null || curve.isEmpty()) {
            return chart;
        }

        List<Date> xData = new ArrayList<>();
        List<Double> drawdown = new ArrayList<>();
        for (EquityPoint point : curve) {
            xData.add(Date.from(point.getTimestamp()));
            drawdown.add(-point.getDrawdown());
        }
        XYSeries series = chart.addSeries("Drawdown", xData, drawdown);
        series.setMarker(SeriesMarkers.NONE);
        series.setFillColor(new Color(220, 60, 60, 120));

        return chart;
    }

    /**
     * Saves equity and drawdown charts as PNG files into the directory.
     */
    public List<Path> export(BacktestResult result, Path directory) {
        String baseName = result.getSymbol() + "_" + result.getStrategyName().replaceAll("[^A-Za-z0-9]+", "_");
        Path equityFile = directory.resolve(baseName + "_equity");
        Path drawdownFile = directory.resolve(baseName + "_drawdown");

        try {
            Files.createDirectories(directory);
            BitmapEncoder.saveBitmap(createEquityChart(result), equityFile.toString(), BitmapEncoder.BitmapFormat.PNG);
            BitmapEncoder.saveBitmap(createDrawdownChart(result), drawdownFile.toString(), BitmapEncoder.BitmapFormat.PNG);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not save charts of " + result.getSymbol(), e);
        }

        log.info("Charts of {} saved to {}", result.getSymbol(), directory);
        return List.of(Path.of(equityFile + ".png"), Path.of(drawdownFile + ".png"));
    }
}
