package com.useless.script.present;

import java.io.PrintStream;

import com.useless.script.parser.Value;

public class ConsolePresenter implements Presenter {
    private final PrintStream out;
    private final PrintStream err;

    public ConsolePresenter(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public ConsolePresenter() {
        this(System.out, System.err);
    }

    @Override
    public void present(Value value) {
        out.println(ValueJson.display(value));
    }

    @Override
    public void presentError(String message) {
        err.println("💥 " + message);
    }
}
