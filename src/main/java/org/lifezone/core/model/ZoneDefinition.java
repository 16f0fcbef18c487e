package org.lifezone.core.model;

/**
 * Строка таблицы зон. index с единицы, совпадает с veg class.
 * Рёбра - нижние границы шестиугольника по каждой оси.
 */
public record ZoneDefinition(int index, double biotempEdge, double precipEdge, double petRatioEdge, String name) {
}
