package ch.xavier.crossover.bar;

public interface SymbolInfoProvider {

    SymbolInfo getSymbolInfo(String symbol);
}
