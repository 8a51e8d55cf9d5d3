package com.khaounen.security.sessionrisk;

@FunctionalInterface
public interface TurnClassifier {
    TurnClassification classify(String turnText);
}
