module money.main {
    exports com.amannmalik.money.api;
    exports com.amannmalik.money.format;
    exports com.amannmalik.money.spi.format;
    exports com.amannmalik.money.util;
}
