package com.cartsafety.signal.service;

import com.cartsafety.common.signal.ContingencyTable;
import com.cartsafety.signal.client.ReportQuery;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the 2x2 table of one drug-event pair from four counts: cases, drug total,
 * event total and the unfiltered database total.
 *
 * <p>Name variants are tried in order until one has reports for the drug; that variant
 * is then used for the case count so both drug-row cells come from the same term.
 * Queries run one after another so each pays the request budget in turn.
 */
@Component
public class ContingencyTableFetcher {

    private final ReportCountGateway gateway;

    public ContingencyTableFetcher(ReportCountGateway gateway) {
        this.gateway = gateway;
    }

    Mono<TableFetch> fetch(List<String> searchTerms, String event, LocalDate asOf) {
        return Flux.fromIterable(searchTerms)
            .concatMap(term -> gateway.count(ReportQuery.drugTotal(term, asOf)))
            .takeUntil(lookup -> lookup.count() > 0)
            .collectList()
            .flatMap(drugLookups -> {
                CountLookup drug = drugLookups.get(drugLookups.size() - 1);
                if (drug.count() == 0) {
                    return Mono.just(TableFetch.insufficient(null, drugLookups,
                        "no reports for any of " + searchTerms));
                }
                String term = drug.query().drugTerm();
                return gateway.count(ReportQuery.cases(term, event, asOf))
                    .flatMap(cases -> gateway.count(ReportQuery.eventTotal(event, asOf))
                        .flatMap(eventTotal -> gateway.count(ReportQuery.databaseTotal(asOf))
                            .map(databaseTotal -> {
                                List<CountLookup> lookups = new ArrayList<>(drugLookups);
                                lookups.add(cases);
                                lookups.add(eventTotal);
                                lookups.add(databaseTotal);
                                if (eventTotal.count() == 0) {
                                    return TableFetch.insufficient(term, lookups, "no reports for event " + event);
                                }
                                return TableFetch.complete(term, ContingencyTable.fromMarginals(
                                    cases.count(), drug.count(), eventTotal.count(), databaseTotal.count()), lookups);
                            })));
            });
    }
}
