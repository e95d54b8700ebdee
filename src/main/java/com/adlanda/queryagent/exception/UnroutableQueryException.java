package com.adlanda.queryagent.exception;

public class UnroutableQueryException extends AgentException {

    public UnroutableQueryException(String query) {
        super(ErrorKind.UNROUTABLE_QUERY,
                "Query is not a weather question and no document is indexed to answer it: '" + query + "'");
    }
}
