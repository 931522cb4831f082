package com.useless.script.present;

import com.useless.script.parser.Value;

/** Where {@code print} output and uncaught errors go. */
public interface Presenter {
    void present(Value value);

    void presentError(String message);
}
