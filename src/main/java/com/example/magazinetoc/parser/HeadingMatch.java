package com.example.magazinetoc.parser;

public class HeadingMatch {
    private final String name;
    private final Integer page;

    public HeadingMatch(String name, Integer page) {
        this.name = name;
        this.page = page;
    }

    public String getName() {
        return name;
    }

    public Integer getPage() {
        return page;
    }

    public HeadingMatch withPage(Integer newPage) {
        return new HeadingMatch(name, newPage);
    }
}
