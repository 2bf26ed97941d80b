package io.github.yok.sse.out;

import io.github.yok.sse.core.exact.ExactGroundStateReference.ExactResult;
import io.github.yok.sse.core.solver.EnsembleSimulation.EnsembleResult;
import io.github.yok.sse.core.solver.MonteCarloSimulation.MemberResult;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（θ は異方性角、度単位）。
 * </p>
 *
 * <ul>
 * <li>{@code sse_members_theta=45.00.csv}（メンバごとの {@code <m^2>}, {@code <m^4>}, Binder, 平均演算子数）</li>
 * <li>{@code sse_meta_theta=45.00.csv}（入力値、アンサンブル平均と標準誤差、厳密対角化の参照値）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "sse";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * x方向格子点数（Lx）です。
     */
    private final int lx;

    /**
     * y方向格子点数（Ly）です。
     */
    private final int ly;

    /**
     * 最近接結合 J です。
     */
    private final double coupling;

    /**
     * 一様横磁場 h です。
     */
    private final double field;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param lx x方向格子点数（1以上）
     * @param ly y方向格子点数（1以上）
     * @param coupling 最近接結合 J です（メタ情報用）
     * @param field 一様横磁場 h です（メタ情報用）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, int lx, int ly, double coupling, double field) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        if (lx <= 0 || ly <= 0) {
            throw new IllegalArgumentException("lx/ly は 1 以上を指定してください: " + lx + "x" + ly);
        }
        this.outputDir = Paths.get(outputDir);
        this.lx = lx;
        this.ly = ly;
        this.coupling = coupling;
        this.field = field;
    }

    /**
     * アンサンブルの集計結果を出力します。
     *
     * @param anisotropyAngle 異方性角 θ（度）です
     * @param ensemble アンサンブルの集計結果です
     * @param exact 厳密対角化の参照値です（null 可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(double anisotropyAngle, EnsembleResult ensemble, ExactResult exact) {
        if (!Double.isFinite(anisotropyAngle)) {
            throw new IllegalArgumentException("異方性角 θ は有限値を指定してください: " + anisotropyAngle);
        }
        if (ensemble == null) {
            throw new IllegalArgumentException("ensemble は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) メンバごとの結果
            writeMembersCsv(anisotropyAngle, ensemble.getMembers());

            // 2) メタ（入力値、平均と標準誤差、参照値）
            writeMetaCsv(anisotropyAngle, ensemble, exact);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * メンバごとの結果を出力します。
     *
     * @param anisotropyAngle 異方性角 θ です
     * @param members メンバごとの結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMembersCsv(double anisotropyAngle, List<MemberResult> members)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("members", anisotropyAngle));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("member", "samples", "m2", "m4", "binder",
                                "meanDiagonalField", "meanOffDiagonalField", "meanBond")
                        .build().print(w)) {

            for (int k = 0; k < members.size(); k++) {
                MemberResult r = members.get(k);
                pr.printRecord(k, r.getSamples(), r.getMeanSquare(), r.getMeanFourth(),
                        r.getBinderCumulant(), r.getMeanDiagonalFieldCount(),
                        r.getMeanOffDiagonalFieldCount(), r.getMeanBondCount());
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param anisotropyAngle 異方性角 θ です
     * @param ensemble アンサンブルの集計結果です
     * @param exact 厳密対角化の参照値です（null なら参照値の行を出力しません）
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(double anisotropyAngle, EnsembleResult ensemble, ExactResult exact)
            throws IOException {

        Path file = outputDir.resolve(buildFileName("meta", anisotropyAngle));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("input.theta", anisotropyAngle);
            pr.printRecord("input.J", coupling);
            pr.printRecord("input.h", field);
            pr.printRecord("lx", lx);
            pr.printRecord("ly", ly);
            pr.printRecord("siteCount", lx * ly);
            pr.printRecord("members", ensemble.getMembers().size());

            pr.printRecord("binder.mean", ensemble.getBinderMean());
            pr.printRecord("binder.stderr", ensemble.getBinderStandardError());
            pr.printRecord("m2.mean", ensemble.getMeanSquareMean());
            pr.printRecord("m2.stderr", ensemble.getMeanSquareStandardError());

            if (exact != null) {
                pr.printRecord("exact.energy", exact.getGroundStateEnergy());
                pr.printRecord("exact.gap", exact.getGap());
                pr.printRecord("exact.m2", exact.getMeanSquare());
                pr.printRecord("exact.m4", exact.getMeanFourth());
                pr.printRecord("exact.binder", exact.getBinderCumulant());
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code sse_meta_theta=45.00.csv}
     * </p>
     *
     * @param kind 出力の識別子（members/meta）
     * @param anisotropyAngle 異方性角 θ です
     * @return ファイル名です
     */
    static String buildFileName(String kind, double anisotropyAngle) {
        return FILE_HEAD + "_" + kind + "_theta=" + formatTheta(anisotropyAngle) + ".csv";
    }

    /**
     * 異方性角 θ を小数点以下2桁に整形します（ファイル名用）。
     *
     * @param theta 異方性角です
     * @return 整形文字列（例: 45.00）
     */
    private static String formatTheta(double theta) {
        return String.format(Locale.ROOT, "%.2f", theta);
    }
}
