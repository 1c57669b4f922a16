package com.example.retrain;

/** No model artifact has been promoted yet. */
public class NoCurrentModelException extends IllegalStateException {

    public NoCurrentModelException() {
        super("No model is currently serving");
    }
}
