module io.github.cyfko.logictree.core {
    requires com.fasterxml.jackson.databind;
    requires java.logging;

    exports io.github.cyfko.logictree.core;
    exports io.github.cyfko.logictree.core.api;
    exports io.github.cyfko.logictree.core.config;
    exports io.github.cyfko.logictree.core.eval;
    exports io.github.cyfko.logictree.core.exception;
    exports io.github.cyfko.logictree.core.format;
    exports io.github.cyfko.logictree.core.spi;
    exports io.github.cyfko.logictree.core.table;
}
