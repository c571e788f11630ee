package com.sem.lcs;

import com.sem.lcs.dsl.LcsConfig;

import java.nio.file.Path;

import lombok.extern.log4j.Log4j2;

/**
 * Prints both renderings of a model.
 *
 * <p>
 * Usage: {@code LcsSpecDemo [model.json]}. Without an argument, the bivariate
 * coupled stochastic model over five occasions is shown.
 */
@Log4j2
public class LcsSpecDemo {

    public static void main(String[] args) {
        log.info("Starting LCS specification demo...");

        LcsModel model;
        if (args.length > 0) {
            model = LcsModel.load(Path.of(args[0]));
        } else {
            model = LcsModel.build(LcsConfig.builder()
                    .name("bivariate_dual_change")
                    .horizon(5)
                    .processes("X", "Y")
                    .coupled(true)
                    .stochastic(true)
                    .build());
        }

        log.info("\n{}", model.explain().summary());
        System.out.println(model.pathListText());
        model.equationText().forEach(System.out::println);
    }
}
