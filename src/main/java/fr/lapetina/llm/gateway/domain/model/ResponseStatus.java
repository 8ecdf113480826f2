package fr.lapetina.llm.gateway.domain.model;

public enum ResponseStatus {
    SUCCESS,
    ERROR
}
