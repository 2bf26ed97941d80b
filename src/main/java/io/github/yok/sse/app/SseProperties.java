package io.github.yok.sse.app;

import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * sse-solver の設定値（sse.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "sse")
public class SseProperties {

    /**
     * 格子設定です。
     */
    @Valid
    private Lattice lattice = new Lattice();

    /**
     * モデル設定です。
     */
    @Valid
    private Model model = new Model();

    /**
     * モンテカルロ計算の設定です。
     */
    @Valid
    private Simulation simulation = new Simulation();

    /**
     * 厳密対角化による参照値計算の設定です。
     */
    @Valid
    private ExactReference exactReference = new ExactReference();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "sse")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Lattice l = getLattice();
        Model m = getModel();
        Simulation s = getSimulation();
        ExactReference e = getExactReference();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "lattice",
                // lx: x方向の格子点数
                "lx", l.getLx(),
                // ly: y方向の格子点数
                "ly", l.getLy(),
                // boundary: 境界条件（OPEN/PERIODIC）
                "boundary", l.getBoundary());

        appendSection(sb, nl, "model",
                // coupling: 最近接結合 J（正で反強磁性）
                "coupling", m.getCoupling(),
                // field: 一様横磁場 h
                "field", m.getField(),
                // anisotropyAngleScan.values: 計算する異方性角 θ（度）の一覧
                "anisotropyAngleScan.values", m.getAnisotropyAngleScan().getValues());

        appendSection(sb, nl, "simulation",
                // halfLength: 演算子列の半分の長さ m（列長は 2m）
                "halfLength", s.getHalfLength(),
                // sweeps: 測定スイープ数
                "sweeps", s.getSweeps(),
                // delay: 平衡化スイープ数
                "delay", s.getDelay(),
                // repetitions: 独立なアンサンブル数
                "repetitions", s.getRepetitions(),
                // seed: 乱数シードの基準値
                "seed", s.getSeed(),
                // maxInsertionAttempts: 演算子挿入の棄却サンプリング試行回数上限
                "maxInsertionAttempts", s.getMaxInsertionAttempts(),
                // observable: 磁化の種類（STAGGERED/UNIFORM）
                "observable", s.getObservable(),
                // validateEverySweep: 毎スイープで演算子列の整合性を検証するかどうか
                "validateEverySweep", s.isValidateEverySweep());

        appendSection(sb, nl, "exactReference",
                // enabled: 小さい系で厳密対角化の参照値を計算するかどうか
                "enabled", e.isEnabled(),
                // maxSites: 厳密対角化を行うサイト数の上限
                "maxSites", e.getMaxSites());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Lattice {

        /**
         * x方向サイズ（Lx）です。
         */
        @Min(1)
        private int lx = 4;

        /**
         * y方向サイズ（Ly）です。
         */
        @Min(1)
        private int ly = 4;

        /**
         * 境界条件です。
         */
        @NotNull
        private Boundary boundary = Boundary.PERIODIC;

        public enum Boundary {
            OPEN, PERIODIC
        }
    }

    @Data
    public static class Model {

        /**
         * 最近接結合 J です（正で反強磁性、負で強磁性）。
         */
        private double coupling = 1.0;

        /**
         * 一様横磁場 h です。
         */
        private double field = 1.0;

        /**
         * 異方性角 θ を指定して計算を繰り返す設定です。
         *
         * <p>
         * 横ボンドは {@code J cos θ}、縦ボンドは {@code J sin θ} になります。
         * </p>
         */
        @Valid
        private AnisotropyAngleScan anisotropyAngleScan = new AnisotropyAngleScan();

        @Data
        public static class AnisotropyAngleScan {

            /**
             * 計算する異方性角 θ（度）の一覧です。
             */
            @NotEmpty
            private List<Double> values = List.of(45.0);
        }
    }

    @Data
    public static class Simulation {

        /**
         * 演算子列の半分の長さ m です（演算子列長は 2m）。
         */
        @Min(1)
        private int halfLength = 400;

        /**
         * 測定に使うスイープ数です。
         */
        @Min(1)
        private int sweeps = 5000;

        /**
         * 測定前に捨てる平衡化スイープ数です。
         */
        @Min(0)
        private int delay = 1000;

        /**
         * 独立なアンサンブル（乱数列）の数です。
         */
        @Min(1)
        private int repetitions = 8;

        /**
         * 乱数シードの基準値です（アンサンブル番号を加算して使います）。
         */
        private long seed = 20240101L;

        /**
         * 1 スロットあたりの演算子挿入試行回数の上限です。
         */
        @Min(1)
        private int maxInsertionAttempts = 1_000_000;

        /**
         * 測定する磁化の種類です。
         */
        @NotNull
        private Observable observable = Observable.STAGGERED;

        /**
         * 毎スイープ後に演算子列の整合性を検証するかどうかです（診断用）。
         */
        private boolean validateEverySweep = false;

        public enum Observable {
            STAGGERED, UNIFORM
        }
    }

    @Data
    public static class ExactReference {

        /**
         * 厳密対角化の参照値を計算するかどうかです。
         */
        private boolean enabled = true;

        /**
         * 厳密対角化を行うサイト数の上限です（ヒルベルト空間次元は 2^N）。
         */
        @Min(1)
        @Max(14)
        private int maxSites = 12;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
